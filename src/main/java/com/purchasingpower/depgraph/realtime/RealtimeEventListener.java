package com.purchasingpower.depgraph.realtime;

@FunctionalInterface
public interface RealtimeEventListener {

    void onEvent(RealtimeEvent event);
}
