package com.example.loankeeper;

import com.example.loankeeper.cli.LoanCommands;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Starts the HTTP service with its scheduler, or, when the first argument is one of
 * {@link LoanCommands#COMMANDS}, runs that command once without a web server and exits.
 */
@SpringBootApplication
@EnableScheduling
public class LoanKeeperApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LoanKeeperApplication.class);
        if (args.length > 0 && LoanCommands.COMMANDS.contains(args[0])) {
            app.setWebApplicationType(WebApplicationType.NONE);
            app.setDefaultProperties(Map.of(
                    "loan.cli.command", args[0],
                    "loan.scheduler.enabled", "false"));
            ConfigurableApplicationContext context = app.run(args);
            System.exit(SpringApplication.exit(context));
        }
        app.run(args);
    }
}
