package dk.cloudcreate.essentials.components.eventsourced.deciders.application;

import java.util.*;

public final class RecordingActionPublisher<A> implements ActionPublisher<A> {
    private final List<List<A>> published = new ArrayList<>();

    @Override
    public void publish(List<A> actions) {
        published.add(actions);
    }

    public List<List<A>> published() {
        return published;
    }
}
