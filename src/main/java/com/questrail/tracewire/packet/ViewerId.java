package com.questrail.tracewire.packet;

/**
 * Viewer hint carried by a {@link LogEntry}; tells the console how to
 * render the entry's data block.
 */
public enum ViewerId {
    NO_VIEWER(-1),
    TITLE(0),
    DATA(1),
    LIST(2),
    VALUE_LIST(3),
    INSPECTOR(4),
    TABLE(5),
    WEB(100),
    BINARY(200),
    HTML_SOURCE(300),
    JAVASCRIPT_SOURCE(301),
    VBSCRIPT_SOURCE(302),
    PERL_SOURCE(303),
    SQL_SOURCE(304),
    INI_SOURCE(305),
    PYTHON_SOURCE(306),
    XML_SOURCE(307),
    BITMAP(400),
    JPEG(401),
    ICON(402),
    METAFILE(403),
    PNG(404);

    private final int id;

    ViewerId(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static ViewerId fromId(int id) {
        for (ViewerId v : values()) {
            if (v.id == id) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown viewer id: " + id);
    }
}
