package dev.fragmenter.splitting;

/**
 * Kind of content a source was classified as: HTML markup or plain prose.
 */
public enum FragmentType {
    HTML("html", "html"),
    TEXT("text", "txt");

    private final String value;
    private final String fileExtension;

    FragmentType(String value, String fileExtension) {
        this.value = value;
        this.fileExtension = fileExtension;
    }

    public String value() {
        return value;
    }

    /** File extension (without the dot) used when a fragment of this type is written to disk. */
    public String fileExtension() {
        return fileExtension;
    }

    public static FragmentType fromValue(String value) {
        for (FragmentType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid fragment type: " + value);
    }
}
