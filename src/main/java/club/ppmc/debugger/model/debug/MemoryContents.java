/**
 * MemoryContents.java
 *
 * memory_read 事件的数据负载。
 *
 * @param address 起始地址。
 * @param contents 内容，以成对十六进制数字表示。
 */
package club.ppmc.debugger.model.debug;

public record MemoryContents(String address, String contents) {

    public static MemoryContents of(MemoryBlock block) {
        return new MemoryContents(block.baseAddress(), block.toHex());
    }
}
