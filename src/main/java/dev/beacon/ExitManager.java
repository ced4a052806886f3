package dev.beacon;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Manages application exit.
 * Separated so tests and embedding callers can keep the JVM alive.
 */
@Slf4j
@Component
public class ExitManager {

    private final boolean exitOnCompletion;

    public ExitManager(@Value("${beacon.runner.exit-on-completion:true}") boolean exitOnCompletion) {
        this.exitOnCompletion = exitOnCompletion;
    }

    public void exit(int status) {
        if (!exitOnCompletion) {
            log.info("Exit with status {} suppressed (beacon.runner.exit-on-completion=false)", status);
            return;
        }
        System.exit(status);
    }

    public boolean isExitOnCompletion() {
        return exitOnCompletion;
    }
}
