/**
 * LocationInfo.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装程序暂停时的精确位置信息。
 * 它是 StateSnapshot 的一部分，取自 *stopped 记录中的 frame。
 */
package club.ppmc.debugger.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

/**
 * @param file 暂停点所在的源文件。
 * @param line 暂停点所在的行号。
 * @param function 暂停点所在的函数名。
 */
public record LocationInfo(
        String file, int line, @SerializedName("func") @JsonProperty("func") String function) {}
