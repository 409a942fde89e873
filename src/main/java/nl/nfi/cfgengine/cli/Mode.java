package nl.nfi.cfgengine.cli;

public enum Mode {
    GENERATE,
    RECOGNIZE,
    RECOGNIZE_ABC
}
