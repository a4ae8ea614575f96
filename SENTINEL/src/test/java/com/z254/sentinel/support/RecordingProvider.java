package com.z254.sentinel.support;

import com.z254.sentinel.domain.model.Alert;
import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.notification.NotificationProvider;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Provider stub that records every send and answers with a configurable result.
 */
public class RecordingProvider implements NotificationProvider {

    private final NotificationChannel channel;
    private final List<List<String>> sends = new CopyOnWriteArrayList<>();
    private volatile Mono<Boolean> result = Mono.just(true);

    public RecordingProvider(NotificationChannel channel) {
        this.channel = channel;
    }

    public RecordingProvider failing(RuntimeException error) {
        this.result = Mono.error(error);
        return this;
    }

    public RecordingProvider answering(boolean accepted) {
        this.result = Mono.just(accepted);
        return this;
    }

    public RecordingProvider answering(Mono<Boolean> result) {
        this.result = result;
        return this;
    }

    public List<List<String>> sends() {
        return sends;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public Mono<Boolean> send(Alert alert, List<String> recipients) {
        sends.add(recipients);
        return result;
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return result.onErrorReturn(false);
    }
}
