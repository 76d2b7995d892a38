package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.Deadline;

import java.util.List;
import java.util.function.Consumer;

public class SequentialFrontierExpander implements FrontierExpander {

    @Override
    public void expand(List<String> frontier, Consumer<String> expandOne, Deadline deadline) {
        for (String address : frontier) {
            if (deadline.isExpired()) {
                return;
            }
            expandOne.accept(address);
        }
    }
}
