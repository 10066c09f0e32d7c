package com.appforge.dispatch.cli;

import com.appforge.core.breaker.CircuitBreaker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "breaker-reset", mixinStandardHelpOptions = true,
        description = "Force the sandbox circuit breaker back to CLOSED")
@Component
public class BreakerResetCommand implements Runnable {

    private final CircuitBreaker circuitBreaker;

    public BreakerResetCommand(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public void run() {
        circuitBreaker.reset();
        ConsoleOutput.success("Circuit breaker " + circuitBreaker.getName() + " is "
                + circuitBreaker.state().state());
    }
}
