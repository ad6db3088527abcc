/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.classify;

import io.errorflow4j.core.api.model.ErrorCategory;
import io.errorflow4j.core.api.shape.CodedError;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;
import java.util.Optional;

/** POSIX error codes with a fixed category. Exact code match wins over any keyword in the message. */
public enum OsErrorCode {
    ENOENT(ErrorCategory.FILE_NOT_FOUND, null),
    EISDIR(ErrorCategory.PATH_IS_DIRECTORY, "is a directory"),
    ENOTDIR(ErrorCategory.NOT_A_DIRECTORY, "not a directory"),
    ENOTEMPTY(ErrorCategory.DIRECTORY_NOT_EMPTY, "directory not empty"),
    EEXIST(ErrorCategory.FILE_EXISTS, null),
    EACCES(ErrorCategory.ACCESS_DENIED, "permission denied"),
    EBUSY(ErrorCategory.FILE_BUSY, "device or resource busy"),
    EFBIG(ErrorCategory.FILE_TOO_LARGE, "file too large"),
    ENAMETOOLONG(ErrorCategory.FILE_NAME_TOO_LONG, "file name too long"),
    ENOSPC(ErrorCategory.NO_SPACE, "no space left on device"),
    EROFS(ErrorCategory.READ_ONLY_FILE_SYSTEM, "read-only file system");

    private final ErrorCategory category;
    /** strerror(3) text as it shows up in {@link FileSystemException#getReason()}. */
    private final String reasonPhrase;

    OsErrorCode(ErrorCategory category, String reasonPhrase) {
        this.category = category;
        this.reasonPhrase = reasonPhrase;
    }

    public ErrorCategory category() {
        return category;
    }

    public static Optional<OsErrorCode> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        for (OsErrorCode c : values()) {
            if (c.name().equals(code)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /**
     * Raw error code carried by a throwable: {@link CodedError#getCode()} when implemented, otherwise the
     * code equivalent of a {@code java.nio.file} exception. Null when nothing resolves.
     */
    public static String codeOf(Throwable t) {
        if (t == null) return null;
        if (t instanceof CodedError ce) {
            String code = ce.getCode();
            if (code != null && !code.isBlank()) return code;
        }
        // subclasses before FileSystemException
        if (t instanceof NoSuchFileException) return ENOENT.name();
        if (t instanceof FileAlreadyExistsException) return EEXIST.name();
        if (t instanceof DirectoryNotEmptyException) return ENOTEMPTY.name();
        if (t instanceof NotDirectoryException) return ENOTDIR.name();
        if (t instanceof AccessDeniedException) return EACCES.name();
        if (t instanceof FileSystemException fse && fse.getReason() != null) {
            String reason = fse.getReason().toLowerCase(Locale.ROOT);
            for (OsErrorCode c : values()) {
                if (c.reasonPhrase != null && reason.contains(c.reasonPhrase)) return c.name();
            }
        }
        return null;
    }

    public static Optional<OsErrorCode> resolve(Throwable t) {
        return fromCode(codeOf(t));
    }
}
