package com.globalai.backend.exception;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.CanonicalInstrument;

public class UnmappedInstrumentException extends RuntimeException {
    private final String ticker;
    private final Broker broker;

    public UnmappedInstrumentException(String ticker, Broker broker) {
        this(ticker, broker, "No " + broker + " listing mapped for " + ticker);
    }

    public UnmappedInstrumentException(CanonicalInstrument instrument, Broker broker) {
        this(instrument.ticker(), broker, "No " + broker + " listing mapped for " + instrument.ticker()
                + (instrument.displayName() != null ? " (" + instrument.displayName() + ")" : ""));
    }

    private UnmappedInstrumentException(String ticker, Broker broker, String message) {
        super(message);
        this.ticker = ticker;
        this.broker = broker;
    }

    public String getTicker() {
        return ticker;
    }

    public Broker getBroker() {
        return broker;
    }
}
