package com.purchasingpower.depgraph.realtime;

@FunctionalInterface
public interface SubscriptionCallback {

    void onUpdate(QueryUpdate update);
}
