package com.starscape.bracketflow.features.trackprogress.domain;

import java.io.IOException;

/**
 * Transport of one live subscriber connection.
 */
public interface EventSink {
    
    void send(JobEvent event) throws IOException;
    
    void heartbeat() throws IOException;
    
    /**
     * Ends the connection. Must be safe to call more than once.
     */
    void complete();
    
    /**
     * Registers a callback for when the client side goes away.
     */
    void onDisconnect(Runnable callback);
}
