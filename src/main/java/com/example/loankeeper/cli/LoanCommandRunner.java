package com.example.loankeeper.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the command named by loan.cli.command once the context is up. The exit code is picked
 * up by {@code SpringApplication.exit}.
 */
@Component
@ConditionalOnProperty(name = "loan.cli.command")
@RequiredArgsConstructor
@Slf4j
public class LoanCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final LoanCommands loanCommands;

    @Value("${loan.cli.command}")
    private String command;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running command '{}'", command);
        exitCode = loanCommands.execute(command);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
