package com.tenacy.tradepulse.broadcast;

import java.io.IOException;

/**
 * A live connection receiving broadcast frames.
 */
public interface Subscriber {

    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;
}
