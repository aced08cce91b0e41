package io.relaybroker.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Represents a single topic entry of the topics.yaml file: a topic the broker creates at startup
 * together with the channels to register on it.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public final class TopicConfig {
    private String name;
    private List<String> channels;
}
