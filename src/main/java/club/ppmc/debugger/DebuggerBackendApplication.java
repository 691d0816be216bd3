/**
 * DebuggerBackendApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableScheduling 注解用于启用定时任务，供 DebugSessionRegistry 回收空闲会话使用。
 */
package club.ppmc.debugger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DebuggerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebuggerBackendApplication.class, args);
    }
}
