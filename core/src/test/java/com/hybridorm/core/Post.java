package com.hybridorm.core;

class Post extends Entity implements Timestamped {
    static final EntityDefinition DEFINITION = EntityDefinition.builder("posts")
            .resource("articles")
            .fillable("title", "body", "meta", "published", "published_at")
            .cast("meta", CastKind.JSON)
            .cast("published", CastKind.BOOL)
            .cast("published_at", CastKind.DATETIME)
            .cast("views", "int")
            .cast("rating", "double")
            .relation("author", Author::new)
            .relation("comments", Comment::new)
            .hidden("secret")
            .appends("summary")
            .build();

    @Override
    public EntityDefinition definition() {
        return DEFINITION;
    }

    @Override
    public Object getAttribute(String key) {
        if (key.equals("summary")) {
            Object title = super.getAttribute("title");
            return title == null ? null : "Post: " + title;
        }
        return super.getAttribute(key);
    }

    static class Comment extends Entity {
        static final EntityDefinition DEFINITION = EntityDefinition.builder("comments").build();

        @Override
        public EntityDefinition definition() {
            return DEFINITION;
        }
    }
}
