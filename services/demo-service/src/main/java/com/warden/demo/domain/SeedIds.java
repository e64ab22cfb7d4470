package com.warden.demo.domain;

import java.util.UUID;

/** Ids of the rows seeded by {@code data.sql}. */
public final class SeedIds {

    public static final UUID DOC_1 = UUID.fromString("11111111-1111-1111-1111-111111111111");
    public static final UUID DOC_2 = UUID.fromString("22222222-2222-2222-2222-222222222222");
    public static final UUID NOTE_1 = UUID.fromString("33333333-3333-3333-3333-333333333333");
    public static final UUID NOTE_2 = UUID.fromString("44444444-4444-4444-4444-444444444444");

    private SeedIds() {
        // utility class
    }
}
