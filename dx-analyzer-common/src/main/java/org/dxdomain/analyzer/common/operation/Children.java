package org.dxdomain.analyzer.common.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Children {

    private Children() {
    }

    // null entries are absent optional sub-expressions
    static List<Operation> of(Operation... operations) {
        List<Operation> list = new ArrayList<>(operations.length);
        for (Operation operation : operations) {
            if (operation != null) list.add(operation);
        }
        return Collections.unmodifiableList(list);
    }

    static List<Operation> of(Operation first, List<Operation> rest) {
        List<Operation> list = new ArrayList<>(rest.size() + 1);
        if (first != null) list.add(first);
        list.addAll(rest);
        return Collections.unmodifiableList(list);
    }
}
