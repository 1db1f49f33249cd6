package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.engine.Confirmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Asks on the terminal. Without an answer (end of input) the question counts
 * as declined.
 */
@Component
public class ConsoleConfirmer implements Confirmer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleConfirmer.class);

    private final BufferedReader in;
    private final PrintStream out;
    private boolean assumeYes;

    @Autowired
    public ConsoleConfirmer(ReconcilerProperties properties) {
        this(System.in, System.out, properties.isAssumeYes());
    }

    public ConsoleConfirmer(InputStream in, PrintStream out, boolean assumeYes) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.assumeYes = assumeYes;
    }

    public void assumeYes() {
        this.assumeYes = true;
    }

    @Override
    public boolean confirm(String question) {
        if (assumeYes) {
            log.info("{} (assumed yes)", question);
            return true;
        }
        out.print(question + " [y/N] ");
        out.flush();
        try {
            var answer = in.readLine();
            return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            log.warn("Could not read confirmation, treating it as declined: {}", e.getMessage());
            return false;
        }
    }
}
