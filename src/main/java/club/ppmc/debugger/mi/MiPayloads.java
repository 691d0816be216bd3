/**
 * MiPayloads.java
 *
 * 将结果记录中的 MI 元组在边界处立即转换为带类型的领域对象
 * （调用栈、变量、断点、变量对象、内存块），会话代码不直接检查原始元组。
 */
package club.ppmc.debugger.mi;

import club.ppmc.debugger.model.debug.LocationInfo;
import club.ppmc.debugger.model.debug.MemoryBlock;
import club.ppmc.debugger.model.debug.StackFrameInfo;
import club.ppmc.debugger.model.debug.VarObjectInfo;
import club.ppmc.debugger.model.debug.VariableInfo;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

public final class MiPayloads {

    /** 使用 --simple-values 时聚合类型没有值，以此占位。 */
    public static final String AGGREGATE_PLACEHOLDER = "{...}";

    private MiPayloads() {}

    /**
     * 解码 -stack-list-frames 的结果：stack=[frame={...},...]。
     */
    public static List<StackFrameInfo> frames(MiTuple results) {
        List<StackFrameInfo> frames = new ArrayList<>();
        for (MiTuple frame : results.getList("stack").tuples()) {
            frames.add(new StackFrameInfo(
                    frame.getInt("level", frames.size()),
                    frame.optString("addr"),
                    frame.getString("func", "??"),
                    sourceFile(frame),
                    frame.getInt("line", 0)));
        }
        return frames;
    }

    /**
     * 解码 -stack-list-variables 或 -stack-list-locals 的结果。
     */
    public static List<VariableInfo> variables(MiTuple results) {
        MiList list = results.has("variables") ? results.getList("variables") : results.getList("locals");
        List<VariableInfo> variables = new ArrayList<>();
        for (MiValue item : list.items()) {
            if (item instanceof MiTuple var) {
                variables.add(new VariableInfo(
                        var.getString("name", "?"),
                        var.getString("value", AGGREGATE_PLACEHOLDER),
                        var.optString("type")));
            } else if (item.asText() != null) {
                // 不带 --simple-values 时只有名字
                variables.add(new VariableInfo(item.asText(), AGGREGATE_PLACEHOLDER, null));
            }
        }
        return variables;
    }

    /**
     * 从 *stopped 记录的 frame 元组中提取暂停位置；没有 frame 时返回 null。
     */
    public static LocationInfo location(MiTuple stopped) {
        MiTuple frame = stopped.getTuple("frame");
        if (frame.isEmpty()) {
            return null;
        }
        return new LocationInfo(sourceFile(frame), frame.getInt("line", 0), frame.optString("func"));
    }

    /**
     * 解码 bkpt={...}。多位置断点（mi3 的 locations=[...]）取第一个位置的文件与行号。
     */
    public static MiBreakpoint breakpoint(MiTuple bkpt) {
        String file = sourceFile(bkpt);
        int line = bkpt.getInt("line", 0);
        if (file == null || line == 0) {
            List<MiTuple> locations = bkpt.getList("locations").tuples();
            if (!locations.isEmpty()) {
                file = file != null ? file : sourceFile(locations.get(0));
                line = line != 0 ? line : locations.get(0).getInt("line", 0);
            }
        }
        return new MiBreakpoint(
                bkpt.optString("number"),
                file,
                line,
                bkpt.optString("original-location"),
                "del".equals(bkpt.optString("disp")));
    }

    /**
     * 解码 -var-create 的结果。
     */
    public static VarObjectInfo varObject(String expression, MiTuple results) {
        return new VarObjectInfo(
                expression,
                results.optString("name"),
                results.getString("value", ""),
                results.optString("type"),
                results.getInt("numchild", 0));
    }

    /**
     * 解码 -var-list-children 的结果：children=[child={...},...]。
     */
    public static List<VarObjectInfo> children(MiTuple results) {
        List<VarObjectInfo> children = new ArrayList<>();
        for (MiTuple child : results.getList("children").tuples()) {
            children.add(new VarObjectInfo(
                    child.getString("exp", child.optString("name")),
                    child.optString("name"),
                    child.getString("value", ""),
                    child.optString("type"),
                    child.getInt("numchild", 0)));
        }
        return children;
    }

    /**
     * 解码 -data-read-memory-bytes 的结果：memory=[{begin,offset,end,contents},...]。
     * 只拼接从第一个块起地址连续的部分，遇到空洞即停止。
     *
     * @return 内存块；结果中没有任何块时返回 null。
     */
    public static MemoryBlock memory(MiTuple results) {
        List<MiTuple> blocks = results.getList("memory").tuples();
        if (blocks.isEmpty()) {
            return null;
        }
        String baseAddress = blocks.get(0).getString("begin", "0x0");
        var bytes = new ByteArrayOutputStream();
        BigInteger expected = null;
        for (MiTuple block : blocks) {
            BigInteger begin = parseAddress(block.optString("begin"));
            if (expected != null && begin != null && !begin.equals(expected)) {
                break;
            }
            byte[] contents = HexFormat.of().parseHex(block.getString("contents", ""));
            bytes.writeBytes(contents);
            expected = begin == null ? null : begin.add(BigInteger.valueOf(contents.length));
        }
        return new MemoryBlock(baseAddress, bytes.toByteArray());
    }

    private static BigInteger parseAddress(String address) {
        if (address == null) {
            return null;
        }
        String hex = address.startsWith("0x") || address.startsWith("0X") ? address.substring(2) : address;
        try {
            return new BigInteger(hex, 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String sourceFile(MiTuple tuple) {
        String fullname = tuple.optString("fullname");
        return fullname != null ? fullname : tuple.optString("file");
    }
}
