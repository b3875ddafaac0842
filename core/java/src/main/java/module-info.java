module io.github.cyfko.cnfcyk.core {
    requires java.logging;

    exports io.github.cyfko.cnfcyk.core.api;
    exports io.github.cyfko.cnfcyk.core.config;
    exports io.github.cyfko.cnfcyk.core.exception;
    exports io.github.cyfko.cnfcyk.core.impl;
    exports io.github.cyfko.cnfcyk.core.model;
    exports io.github.cyfko.cnfcyk.core.normalization;
    exports io.github.cyfko.cnfcyk.core.parsing;
    exports io.github.cyfko.cnfcyk.core.spi;
    exports io.github.cyfko.cnfcyk.core.utils;
}
