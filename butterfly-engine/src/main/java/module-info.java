module com.butterfly.engine {
    // Internal modules
    requires transitive com.butterfly.core;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.butterfly.engine;
    exports com.butterfly.engine.viz;
}
