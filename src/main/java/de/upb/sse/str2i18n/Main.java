package de.upb.sse.str2i18n;

import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;

public class Main {
    static final String USAGE = "Usage: str2i18n <input.java> <output.java>";

    public static void main(String[] args) {
        int status = run(args);
        if (status != Str2I18n.OK) System.exit(status);
    }

    static int run(String[] args) {
        if (args.length != 2) {
            System.err.println(USAGE);
            return 1;
        }
        final int INPUT = 0;
        final int OUTPUT = 1;

        Str2I18n str2I18n = new Str2I18n(Str2I18nConfiguration.fromSystemProperties());
        return str2I18n.localize(args[INPUT], args[OUTPUT]);
    }
}
