package com.zia.ziacoinsystem.exception;

import com.google.gson.JsonParseException;
import lombok.Getter;

/**
 * 收到无法识别的消息类型
 */
@Getter
public class UnknownMessageTypeException extends JsonParseException {

    private final String type;

    public UnknownMessageTypeException(String type) {
        super("未知的消息类型: " + type);
        this.type = type;
    }
}
