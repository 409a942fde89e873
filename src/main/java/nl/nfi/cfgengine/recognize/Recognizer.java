package nl.nfi.cfgengine.recognize;

// anything that decides membership of a string, optionally with a witness trace
@FunctionalInterface
public interface Recognizer {

    MembershipResult recognize(String input);
}
