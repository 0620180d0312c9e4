package dk.cloudcreate.essentials.components.eventsourced.deciders.decider.restaurant;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class MenuItemId extends CharSequenceType<MenuItemId> {

    protected MenuItemId(CharSequence value) {
        super(value);
    }

    public static MenuItemId random() {
        return new MenuItemId(UUID.randomUUID().toString());
    }

    public static MenuItemId of(CharSequence id) {
        return new MenuItemId(id);
    }
}
