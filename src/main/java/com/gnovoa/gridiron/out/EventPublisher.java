package com.gnovoa.gridiron.out;

import com.gnovoa.gridiron.events.HistoryProgressEvent;

public interface EventPublisher {

    void publish(HistoryProgressEvent event);
}
