package org.learningjava.uniagent.domain.model.protocol;

import java.util.Locale;

/**
 * Controller command vocabulary. Every {@link RawCommand} maps to exactly one variant;
 * anything outside the vocabulary becomes {@link Unknown} so the controller can answer it.
 */
public sealed interface Command
        permits Command.RunLint, Command.RunQgCheck, Command.SelfInstruct,
                Command.AskFinal, Command.Finalize, Command.Unknown {

    record RunLint() implements Command {}

    record RunQgCheck() implements Command {}

    record SelfInstruct(String text) implements Command {}

    record AskFinal() implements Command {}

    record Finalize() implements Command {}

    record Unknown(String name, String argument) implements Command {}

    static Command from(RawCommand raw) {
        String name = raw.name();
        String arg = raw.argument();
        String argUpper = arg.toUpperCase(Locale.ROOT);

        switch (name) {
            case "DO":
                if (argUpper.equals("LINT")) return new RunLint();
                if (argUpper.equals("QG_CHECK")) return new RunQgCheck();
                break;
            case "TOSELF":
                return new SelfInstruct(arg);
            case "ASK":
                if (argUpper.equals("FINAL_OK?")) return new AskFinal();
                break;
            case "FINAL":
                return new Finalize();
            default:
                break;
        }
        return new Unknown(name, arg);
    }
}
