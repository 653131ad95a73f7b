package com.opsagent.executor;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.Consumer;

/**
 * Reads a stream of concatenated JSON objects without line buffering, so a single event may be
 * arbitrarily large. The first undecodable value ends decoding; the rest of the stream is
 * discarded so the producer is never blocked on a full pipe.
 */
@Slf4j
public class AgentEventDecoder {

    private final ObjectReader reader;

    public AgentEventDecoder(ObjectMapper objectMapper) {
        ObjectMapper unbounded = objectMapper.copy();
        unbounded.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(Integer.MAX_VALUE)
                .build());
        this.reader = unbounded.readerFor(AgentEvent.class);
    }

    /**
     * @return number of events handed to the sink
     */
    public int decode(InputStream in, Consumer<AgentEvent> sink) {
        int decoded = 0;
        MappingIterator<AgentEvent> events = null;
        try {
            events = reader.readValues(in);
            while (events.hasNextValue()) {
                AgentEvent event = events.nextValue();
                decoded++;
                log.debug("Agent event {}: type={}", decoded, event.type());
                sink.accept(event);
            }
        } catch (IOException ex) {
            log.warn("Stopped decoding agent events after {} events: {}", decoded, ex.getMessage());
            discardRemainder(in);
        } finally {
            closeQuietly(events);
        }
        return decoded;
    }

    private void discardRemainder(InputStream in) {
        try {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException ex) {
            log.debug("Failed to drain agent output after decode error: {}", ex.getMessage());
        }
    }

    private void closeQuietly(MappingIterator<AgentEvent> events) {
        if (events == null) {
            return;
        }
        try {
            events.close();
        } catch (IOException ex) {
            log.debug("Failed to close agent event stream: {}", ex.getMessage());
        }
    }
}
