/**
 * ResultClass.java
 *
 * 结果记录 (^...) 的结果类别。
 */
package club.ppmc.debugger.mi;

public enum ResultClass {
    DONE("done"),
    RUNNING("running"),
    CONNECTED("connected"),
    ERROR("error"),
    EXIT("exit");

    private final String wireName;

    ResultClass(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    static ResultClass fromWire(String name) throws MiParseException {
        for (ResultClass rc : values()) {
            if (rc.wireName.equals(name)) {
                return rc;
            }
        }
        throw new MiParseException("未知的结果类别: " + name);
    }
}
