/**
 * MemoryBlock.java
 *
 * 一次内存读取的结果快照。每次新的读取请求都会整体替换上一次的结果，不做合并。
 */
package club.ppmc.debugger.model.debug;

import java.util.HexFormat;

/**
 * @param baseAddress 起始地址，由 gdb 给出（例如 "0x7fffffffe3a0"）。
 * @param rawBytes 读取到的原始字节。
 */
public record MemoryBlock(String baseAddress, byte[] rawBytes) {

    public MemoryBlock {
        rawBytes = rawBytes == null ? new byte[0] : rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public int size() {
        return rawBytes.length;
    }

    /**
     * 以成对十六进制数字表示的内容，例如 "48656c6c6f"。
     */
    public String toHex() {
        return HexFormat.of().formatHex(rawBytes);
    }

    public static MemoryBlock fromHex(String baseAddress, String hex) {
        return new MemoryBlock(baseAddress, HexFormat.of().parseHex(hex));
    }
}
