package dk.cloudcreate.essentials.components.eventsourced.deciders.process.fulfillment;

public enum FulfillmentTask {
    PAYMENT,
    INVENTORY,
    SHIPMENT
}
