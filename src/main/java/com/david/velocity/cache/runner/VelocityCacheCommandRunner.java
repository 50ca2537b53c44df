package com.david.velocity.cache.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 命令行入口：demo | benchmark | all
 *
 * <p>未知命令直接抛出异常，由Spring Boot以非零退出码结束进程。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VelocityCacheCommandRunner implements ApplicationRunner {

    private final CacheDemo demo;
    private final CacheBenchmark benchmark;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            logUsage();
            return;
        }
        execute(commands.get(0));
    }

    /**
     * 执行单个命令
     *
     * @param command 命令名，不区分大小写
     */
    public void execute(String command) {
        switch (command.toLowerCase(Locale.ROOT)) {
            case "demo":
                demo.run();
                break;
            case "benchmark":
                benchmark.runAll();
                break;
            case "all":
                demo.run();
                benchmark.runAll();
                break;
            default:
                log.error("Unknown command: {}", command);
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private void logUsage() {
        log.info("Usage: java -jar velocity-cache.jar [demo|benchmark|all]");
        log.info("  demo      - Run cache demo");
        log.info("  benchmark - Run performance benchmarks");
        log.info("  all       - Run demo and benchmarks");
    }
}
