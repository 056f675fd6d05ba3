package io.dispatch4j.daemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Scheduler process.
 *
 * <p>Without arguments it runs the daemon loop until terminated. With {@code --dispatch.one-shot=true <interval>}
 * it runs a single pass over the templates of that interval and exits.
 */
@SpringBootApplication
public class DispatchDaemonApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DispatchDaemonApplication.class, args);
        if (context.getEnvironment().getProperty("dispatch.one-shot", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
