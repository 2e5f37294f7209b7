package com.github.blockcache.util;

import java.util.zip.CRC32C;

/**
 * CRC-32C（Castagnoli多项式），供存储层校验数据块使用，缓存本身不依赖
 * 底层委托给JDK的CRC32C（可使用硬件指令加速）
 */
public final class Crc32c {
    private static final int MASK_DELTA = 0xa282ead8;

    // 反射多项式 0x82F63B78
    private static final int[] TABLE = new int[256];

    static {
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? 0x82F63B78 ^ (c >>> 1) : c >>> 1;
            }
            TABLE[n] = c;
        }
    }

    private Crc32c() {
    }

    public static int value(byte[] data) {
        return value(data, 0, data.length);
    }

    public static int value(byte[] data, int offset, int length) {
        CRC32C crc = new CRC32C();
        crc.update(data, offset, length);
        return (int) crc.getValue();
    }

    public static int value(Slice slice) {
        return value(slice.rawArray(), slice.rawOffset(), slice.size());
    }

    /**
     * 在已有crc的基础上继续计算：extend(value(A), B) == value(A+B)
     * JDK的CRC32C不支持设置初始值，这里用逐位表驱动实现续算
     */
    public static int extend(int crc, byte[] data, int offset, int length) {
        int c = ~crc;
        for (int i = offset; i < offset + length; i++) {
            c = TABLE[(c ^ data[i]) & 0xff] ^ (c >>> 8);
        }
        return ~c;
    }

    /**
     * 返回crc的掩码形式。对内嵌了crc的数据再算crc会有问题，
     * 因此写入文件的crc应先mask
     */
    public static int mask(int crc) {
        return Integer.rotateRight(crc, 15) + MASK_DELTA;
    }

    public static int unmask(int maskedCrc) {
        int rot = maskedCrc - MASK_DELTA;
        return Integer.rotateLeft(rot, 15);
    }
}
