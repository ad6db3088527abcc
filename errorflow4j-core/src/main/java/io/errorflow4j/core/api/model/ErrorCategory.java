/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.model;

/**
 * Closed taxonomy every captured error is reduced to.
 *
 * <p>Adding a member requires updating the code and keyword tables in
 * {@code io.errorflow4j.core.classify} as well.
 */
public enum ErrorCategory {
    // network / HTTP
    NETWORK(Group.NETWORK),
    HTTP_CLIENT(Group.NETWORK),
    HTTP_SERVER(Group.NETWORK),
    AUTHENTICATION(Group.NETWORK),
    AUTHORIZATION(Group.NETWORK),
    NOT_FOUND(Group.NETWORK),

    // database
    CONNECTION(Group.DATABASE),
    QUERY(Group.DATABASE),
    TRANSACTION(Group.DATABASE),
    CONSTRAINT(Group.DATABASE),
    DATABASE(Group.DATABASE),

    // permission
    PERMISSION(Group.PERMISSION),

    // filesystem
    FILE_NOT_FOUND(Group.FILESYSTEM),
    PATH_IS_DIRECTORY(Group.FILESYSTEM),
    NOT_A_DIRECTORY(Group.FILESYSTEM),
    DIRECTORY_NOT_EMPTY(Group.FILESYSTEM),
    FILE_EXISTS(Group.FILESYSTEM),
    ACCESS_DENIED(Group.FILESYSTEM),
    FILE_BUSY(Group.FILESYSTEM),
    FILE_TOO_LARGE(Group.FILESYSTEM),
    FILE_NAME_TOO_LONG(Group.FILESYSTEM),
    NO_SPACE(Group.FILESYSTEM),
    READ_ONLY_FILE_SYSTEM(Group.FILESYSTEM),

    // UI / test execution
    UI(Group.UI_TEST),
    ELEMENT(Group.UI_TEST),
    NAVIGATION(Group.UI_TEST),
    SELECTOR(Group.UI_TEST),
    ASSERTION(Group.UI_TEST),
    TEST(Group.UI_TEST),
    SETUP(Group.UI_TEST),
    TEARDOWN(Group.UI_TEST),
    FIXTURE(Group.UI_TEST),

    // data
    VALIDATION(Group.DATA),
    IO(Group.DATA),
    PARSING(Group.DATA),
    SERIALIZATION(Group.DATA),

    // resources
    PERFORMANCE(Group.RESOURCE),
    MEMORY(Group.RESOURCE),
    RESOURCE_LIMIT(Group.RESOURCE),

    // misc
    CONFIGURATION(Group.MISC),
    NOT_IMPLEMENTED(Group.MISC),
    SERVICE(Group.MISC),
    TIMEOUT(Group.MISC),
    ENVIRONMENT(Group.MISC),
    DEPENDENCY(Group.MISC),
    CONFLICT(Group.MISC),
    UNKNOWN(Group.MISC);

    private final Group group;

    ErrorCategory(Group group) {
        this.group = group;
    }

    public Group group() {
        return group;
    }

    /** Coarse domain a category belongs to. */
    public enum Group {
        NETWORK,
        DATABASE,
        PERMISSION,
        FILESYSTEM,
        UI_TEST,
        DATA,
        RESOURCE,
        MISC
    }
}
