package com.routely.backend.client;

import com.routely.backend.model.NetworkOverlay;

public interface ServiceStatusApi {

    boolean isEnabled();

    /**
     * Closures and delays currently reported by the operators.
     */
    NetworkOverlay currentOverlay();
}
