// SPDX-License-Identifier: Apache-2.0
open module org.hiero.logging.test {
    exports org.hiero.logging.test;
    exports org.hiero.logging.test.admission;
    exports org.hiero.logging.test.config;
    exports org.hiero.logging.test.facility;
    exports org.hiero.logging.test.junit;
    exports org.hiero.logging.test.sink;

    requires transitive org.apache.logging.log4j;
    requires transitive org.junit.jupiter.api;
    requires org.apache.logging.log4j.core;
    requires static transitive com.github.spotbugs.annotations;
}
