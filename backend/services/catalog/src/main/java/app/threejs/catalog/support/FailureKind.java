package app.threejs.catalog.support;

public enum FailureKind {
    AUTH_REQUIRED,
    AUTH_REFRESH_FAILED,
    REMOTE_REQUEST_FAILED,
    DOWNLOAD_FAILED,
    CONFIG_INVALID
}
