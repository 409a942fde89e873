package nl.nfi.cfgengine.main;

import nl.nfi.cfgengine.cli.CfgEngineCli;
import picocli.CommandLine;

public final class CfgEngineMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CfgEngineCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
