package nl.nfi.cfgengine.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;
import org.slf4j.LoggerFactory;

// writes a rolling log file when LOG_DIRECTORY_PATH is set (see --log_directory_path), logs nothing otherwise
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final String LOG_FILE_NAME = "cfg_engine";

    // the logger context is usually configured before the CLI parses its options, so configure it again
    public static void logTo(final String logDirectoryPath) {
        System.setProperty("LOG_DIRECTORY_PATH", logDirectoryPath);

        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.reset();
        new LoggerConfigurator().configure(loggerContext);
    }

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        final String logDirectoryPath = System.getProperty("LOG_DIRECTORY_PATH");
        if (logDirectoryPath == null) {
            return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
        }

        setContext(loggerContext);

        final Appender<ILoggingEvent> appender = createFileAppender(logDirectoryPath);
        final Logger root = setupLogger("ROOT", "DEBUG", null);
        root.addAppender(appender);

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + LOG_FILE_NAME + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + LOG_FILE_NAME + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(7);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);

        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);

        appender.start();
        return appender;
    }
}
