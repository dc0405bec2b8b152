package io.flagstore;

/**
 * Logger names shared by implementation code in the {@code io.flagstore} package.
 * <p>
 * Components never create their own loggers from class names. The data system creates one base logger
 * and hands each component a sub-logger with one of these stable names, so that a log line shows the
 * relevant area of functionality at a glance and SLF4J filters can be defined on those names.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = "io.flagstore";
  static final String DATA_SOURCE_LOGGER_NAME = "DataSource";
  static final String DATA_STORE_LOGGER_NAME = "DataStore";
}
