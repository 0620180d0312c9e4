package dk.cloudcreate.essentials.components.eventsourced.deciders.decider.restaurant;

import java.math.BigDecimal;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class MenuItem {
    public final MenuItemId menuItemId;
    public final String     name;
    public final BigDecimal price;
    public final boolean    available;

    public MenuItem(MenuItemId menuItemId, String name, BigDecimal price, boolean available) {
        this.menuItemId = requireNonNull(menuItemId, "No menuItemId provided");
        this.name = requireNonNull(name, "No name provided");
        this.price = requireNonNull(price, "No price provided");
        this.available = available;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MenuItem)) return false;
        var that = (MenuItem) o;
        return available == that.available &&
                menuItemId.equals(that.menuItemId) &&
                name.equals(that.name) &&
                price.equals(that.price);
    }

    @Override
    public int hashCode() {
        return Objects.hash(menuItemId, name, price, available);
    }

    @Override
    public String toString() {
        return "MenuItem{" + menuItemId + ", " + name + ", " + price + (available ? "" : ", unavailable") + '}';
    }
}
