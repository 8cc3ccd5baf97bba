package io.github.drompincen.postscheduler.runtime.trigger;

import io.github.drompincen.postscheduler.runtime.dispatch.DispatchCommand;

@FunctionalInterface
public interface TriggerCallback {

    void onFire(String triggerId, DispatchCommand command);
}
