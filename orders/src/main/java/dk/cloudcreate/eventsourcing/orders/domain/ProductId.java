package dk.cloudcreate.eventsourcing.orders.domain;

import dk.cloudcreate.essentials.types.CharSequenceType;

public class ProductId extends CharSequenceType<ProductId> {

    protected ProductId(CharSequence value) {
        super(value);
    }

    public static ProductId of(CharSequence id) {
        return new ProductId(id);
    }
}
