package org.celshape.benchmark.domain;

import java.util.List;

import org.celshape.shape.FieldMember;
import org.celshape.shape.MessageSchema;
import org.celshape.shape.OneofMember;

public final class SampleMessages {

    private SampleMessages() {
    }

    public static final String SIMPLE_RULE = "!has(this.id)";

    public static final String CONJUNCTION_RULE =
            "!has(this.id) && this.status == 'DRAFT' && this.version == 0u && this.address.zip_code == ''";

    public static final String UNION_RULE =
            "(!has(this.created_at) && this.status == 'DRAFT') || !has(this.published_at) || this.address.city == ''";

    public static MessageSchema order() {
        return new MessageSchema("acme.shop.v1.Order", "Order",
                List.of(new FieldMember("id", "string", false),
                        new FieldMember("status", "string", false),
                        new FieldMember("version", "bigint", false),
                        new FieldMember("createdAt", "Timestamp", true),
                        new FieldMember("publishedAt", "Timestamp", true),
                        new FieldMember("address", "Address", true),
                        new OneofMember("payment", List.of(
                                new FieldMember("card", "Card", false),
                                new FieldMember("invoice", "Invoice", false)))),
                List.of(SIMPLE_RULE, CONJUNCTION_RULE, UNION_RULE));
    }
}
