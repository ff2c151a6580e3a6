package com.example.dedupscanner.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Boots the embedded web server around an already opened {@link ManagementConsole}.
 */
@SpringBootApplication
public class ConsoleServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleServer.class);
    private static final long SHUTDOWN_DELAY_MILLIS = 100;

    public static ConfigurableApplicationContext start(ManagementConsole console, int port) {
        ApplicationContextInitializer<ConfigurableApplicationContext> beans = context -> {
            context.getBeanFactory().registerSingleton("managementConsole", console);
            context.getBeanFactory().registerSingleton("consoleShutdown", (ConsoleShutdown) () -> closeLater(context));
        };
        ConfigurableApplicationContext context = new SpringApplicationBuilder(ConsoleServer.class)
                .bannerMode(Banner.Mode.OFF)
                .properties("server.port=" + port)
                .initializers(beans)
                .run();
        LOGGER.info("Web console started at http://localhost:{}", port);
        return context;
    }

    private static void closeLater(ConfigurableApplicationContext context) {
        Thread stopper = new Thread(() -> {
            try {
                // Let the shutdown response reach the client first.
                Thread.sleep(SHUTDOWN_DELAY_MILLIS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            SpringApplication.exit(context);
            LOGGER.info("Web console stopped.");
        }, "console-shutdown");
        stopper.start();
    }
}
