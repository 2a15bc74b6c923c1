module org.dxdomain.analyzer.resultflow {
    requires org.dxdomain.analyzer.common;
    requires org.slf4j;

    exports org.dxdomain.analyzer.resultflow;
    exports org.dxdomain.analyzer.resultflow.impl;
}
