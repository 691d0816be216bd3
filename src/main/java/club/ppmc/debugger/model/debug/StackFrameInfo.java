/**
 * StackFrameInfo.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于表示调用栈中的一个帧（Frame）。
 * 调用栈按由内向外的顺序排列（level 0 为当前帧），每次暂停时整体替换。
 */
package club.ppmc.debugger.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

/**
 * 代表调用栈中的一个帧的记录。
 *
 * @param level 帧层级，0 为最内层。
 * @param address 当前指令地址，例如 "0x0000555555555149"。
 * @param function 函数名。
 * @param file 源文件名；没有调试信息时为 null。
 * @param line 行号；没有调试信息时为 0。
 */
public record StackFrameInfo(
        int level,
        @SerializedName("addr") @JsonProperty("addr") String address,
        @SerializedName("func") @JsonProperty("func") String function,
        String file,
        int line) {}
