module org.dxdomain.analyzer.common {
    requires org.slf4j;

    exports org.dxdomain.analyzer.common;
    exports org.dxdomain.analyzer.common.cfg;
    exports org.dxdomain.analyzer.common.cfg.impl;
    exports org.dxdomain.analyzer.common.config;
    exports org.dxdomain.analyzer.common.operation;
    exports org.dxdomain.analyzer.common.symbol;
    exports org.dxdomain.analyzer.common.type;
}
