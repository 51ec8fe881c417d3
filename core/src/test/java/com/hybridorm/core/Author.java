package com.hybridorm.core;

class Author extends Entity {
    static final EntityDefinition DEFINITION = EntityDefinition.builder("authors")
            .fillable("name")
            .hidden("email")
            .build();

    @Override
    public EntityDefinition definition() {
        return DEFINITION;
    }
}
