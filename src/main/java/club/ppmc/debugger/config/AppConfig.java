/**
 * AppConfig.java
 *
 * 应用级别的基础 Bean：JSON 序列化、HTTP 客户端、时钟，以及调试会话共用的线程池。
 */
package club.ppmc.debugger.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

    /**
     * 用于调用崩溃分析服务的 HTTP 客户端。
     */
    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }

    /**
     * 发往前端的调试事件统一用 Gson 序列化。
     * 保留 null 字段，前端依赖 location 等字段始终存在。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().serializeNulls().create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 断点设置等命令的超时计时器，所有会话共用。
     */
    @Bean(name = "debugTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService debugTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("debug-timeout-"));
    }

    /**
     * 负责排空各通道发送队列的线程池，所有会话共用。
     */
    @Bean(name = "debugDeliveryExecutor", destroyMethod = "shutdown")
    public ExecutorService debugDeliveryExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("debug-delivery-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
