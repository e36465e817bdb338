module com.butterfly.core {
    // Exports - all public packages
    exports com.butterfly.core.model;
    exports com.butterfly.core.viz;
    exports com.butterfly.core.world;
    exports com.butterfly.core.history;
    exports com.butterfly.core.io;
    exports com.butterfly.core.config;

    // Jackson (for model serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires transitive org.slf4j;

    // Jackson needs reflection access to models
    opens com.butterfly.core.model to com.fasterxml.jackson.databind;
    opens com.butterfly.core.viz to com.fasterxml.jackson.databind;
    opens com.butterfly.core.world to com.fasterxml.jackson.databind;
    opens com.butterfly.core.history to com.fasterxml.jackson.databind;
    opens com.butterfly.core.config to com.fasterxml.jackson.databind;
}
