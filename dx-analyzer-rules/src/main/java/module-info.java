module org.dxdomain.analyzer.rules {
    requires org.dxdomain.analyzer.common;
    requires org.dxdomain.analyzer.resultflow;
    requires org.slf4j;

    exports org.dxdomain.analyzer.rules;
    exports org.dxdomain.analyzer.rules.impl;
    exports org.dxdomain.analyzer.rules.scope;
}
