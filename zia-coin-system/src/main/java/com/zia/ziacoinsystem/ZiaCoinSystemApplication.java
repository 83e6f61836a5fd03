package com.zia.ziacoinsystem;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.zia.ziacoinsystem")
public class ZiaCoinSystemApplication {
    public static void main(String[] args) {
        SpringApplication.run(ZiaCoinSystemApplication.class, args);
    }
}
