package com.schemareverse.cli;

import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.SignalDetector;
import picocli.CommandLine.Command;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the procedural constructs the parsers recognize.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * schema-reverse constructs
 * }</pre>
 */
@Command(
    name = "constructs",
    description = "List recognized procedural constructs, their cues and confidence deltas",
    mixinStandardHelpOptions = true
)
public class ConstructsCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Recognized Constructs (dispatch order):");
        System.out.println();
        for (ConstructKind kind : ConstructKind.values()) {
            System.out.printf("  • %s (ID: %s)%n", kind.getDisplayName(), kind.getId());
            System.out.printf("    Cue: %s%n", SignalDetector.describeCue(kind));
            System.out.printf(Locale.ROOT, "    Base delta: %+.2f%n", kind.getBaseDelta());
            System.out.println();
        }
        return 0;
    }
}
