package com.zia.ziacoinsystem.util;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.blockChain.ChainState;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.math.BigDecimal;
import java.util.ArrayList;

/**
 * 序列化工具类（Kryo 5.x）
 */
public class SerializeUtils {

    // 用ThreadLocal存储Kryo实例（每个线程一个独立实例，解决线程安全问题）
    private static final ThreadLocal<Kryo> kryoThreadLocal = ThreadLocal.withInitial(() -> {
        Kryo kryo = new Kryo();
        // 无参构造优先 没有时退回Objenesis
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);

        kryo.register(BigDecimal.class);
        kryo.register(ArrayList.class);
        kryo.register(Block.class);
        kryo.register(Transaction.class);
        kryo.register(ChainState.class);
        return kryo;
    });

    /**
     * 反序列化（从字节数组恢复对象）
     */
    public static Object deSerialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Input input = new Input(bytes)) {
            return kryo.readClassAndObject(input);
        } catch (Exception e) {
            throw new IllegalStateException("反序列化失败: " + e.getMessage(), e);
        }
    }

    /**
     * 序列化（将对象转为字节数组）
     */
    public static byte[] serialize(Object object) {
        if (object == null) {
            return new byte[0];
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Output output = new Output(4096, -1)) {
            kryo.writeClassAndObject(output, object);
            return output.toBytes();
        } catch (Exception e) {
            throw new IllegalStateException("序列化失败: " + e.getMessage(), e);
        }
    }
}
