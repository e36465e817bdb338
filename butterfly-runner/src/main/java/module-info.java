module com.butterfly.runner {
    // Internal modules
    requires com.butterfly.core;
    requires com.butterfly.engine;

    // Data/IO
    requires com.fasterxml.jackson.databind;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.butterfly.runner;

    // Jackson reflection access
    opens com.butterfly.runner to com.fasterxml.jackson.databind;
}
