package me.golemcore.pulse.testsupport;

import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.port.outbound.NotificationPort;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects notifications instead of delivering them.
 */
public class RecordingNotificationPort implements NotificationPort {

    private final String channel;
    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    public RecordingNotificationPort() {
        this("in_app");
    }

    public RecordingNotificationPort(String channel) {
        this.channel = channel;
    }

    @Override
    public String getChannel() {
        return channel;
    }

    @Override
    public void send(Notification notification) {
        sent.add(notification);
    }

    public List<Notification> getSent() {
        return sent;
    }
}
