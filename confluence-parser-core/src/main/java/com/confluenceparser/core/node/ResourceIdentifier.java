package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A reference to a Confluence resource from an {@code ri:} element.
 *
 * <p>Only the fields relevant to the {@link #type()} are set; the rest are null. Use the
 * static factories to build one of a given type.
 *
 * <p><b>Canonical URIs:</b>
 * <ul>
 *   <li>{@code page://SPACE/Title} or {@code page://SPACE/Title@v3}</li>
 *   <li>{@code blog://SPACE/Title@2024-01-15}</li>
 *   <li>{@code attach://diagram.png} or {@code attach://diagram.png@v2}</li>
 *   <li>{@code user://<account id>}</li>
 *   <li>{@code space://SPACE}</li>
 *   <li>{@code contentid://12345}</li>
 *   <li>{@code shortcut://jira/PROJ-1}</li>
 *   <li>the URL itself for {@code ri:url}</li>
 * </ul>
 *
 * @param type resource kind
 * @param contentTitle page or blog post title
 * @param spaceKey space key
 * @param versionAtSave version of the page or attachment when the link was saved
 * @param postingDay blog post day, {@code yyyy/MM/dd} or {@code yyyy-MM-dd}
 * @param filename attachment file name
 * @param value URL of an {@code ri:url}
 * @param accountId user account id
 * @param userkey legacy user key
 * @param localId editor local id
 * @param key shortcut key
 * @param parameter shortcut parameter
 * @param contentId content id
 */
public record ResourceIdentifier(
    ResourceType type,
    String contentTitle,
    String spaceKey,
    Integer versionAtSave,
    String postingDay,
    String filename,
    String value,
    String accountId,
    String userkey,
    String localId,
    String key,
    String parameter,
    String contentId
) implements Node {

    public ResourceIdentifier {
        Objects.requireNonNull(type, "type must not be null");
    }

    // ==================== Factories ====================

    public static ResourceIdentifier page(String spaceKey, String contentTitle, Integer versionAtSave) {
        return new ResourceIdentifier(ResourceType.PAGE, contentTitle, spaceKey, versionAtSave,
            null, null, null, null, null, null, null, null, null);
    }

    public static ResourceIdentifier blogPost(String spaceKey, String contentTitle, String postingDay) {
        return new ResourceIdentifier(ResourceType.BLOG_POST, contentTitle, spaceKey, null,
            postingDay, null, null, null, null, null, null, null, null);
    }

    public static ResourceIdentifier attachment(String filename, Integer versionAtSave, String contentId) {
        return new ResourceIdentifier(ResourceType.ATTACHMENT, null, null, versionAtSave,
            null, filename, null, null, null, null, null, null, contentId);
    }

    public static ResourceIdentifier url(String value) {
        return new ResourceIdentifier(ResourceType.URL, null, null, null,
            null, null, value, null, null, null, null, null, null);
    }

    public static ResourceIdentifier user(String accountId, String userkey, String localId) {
        return new ResourceIdentifier(ResourceType.USER, null, null, null,
            null, null, null, accountId, userkey, localId, null, null, null);
    }

    public static ResourceIdentifier space(String spaceKey) {
        return new ResourceIdentifier(ResourceType.SPACE, null, spaceKey, null,
            null, null, null, null, null, null, null, null, null);
    }

    public static ResourceIdentifier shortcut(String key, String parameter) {
        return new ResourceIdentifier(ResourceType.SHORTCUT, null, null, null,
            null, null, null, null, null, null, key, parameter, null);
    }

    public static ResourceIdentifier contentEntity(String contentId) {
        return new ResourceIdentifier(ResourceType.CONTENT_ENTITY, null, null, null,
            null, null, null, null, null, null, null, null, contentId);
    }

    // ==================== Accessors ====================

    /**
     * Returns a stable URI identifying the referenced resource.
     *
     * @return canonical URI, or null when the identifying fields are missing
     */
    public String canonicalUri() {
        return switch (type) {
            case PAGE -> contentTitle == null ? null
                : "page://" + orEmpty(spaceKey) + "/" + contentTitle + version();
            case BLOG_POST -> contentTitle == null ? null
                : "blog://" + orEmpty(spaceKey) + "/" + contentTitle + "@" + orEmpty(postingDay);
            case ATTACHMENT -> filename == null ? null : "attach://" + filename + version();
            case URL -> value;
            case USER -> accountId == null ? null : "user://" + accountId;
            case SPACE -> spaceKey == null ? null : "space://" + spaceKey;
            case CONTENT_ENTITY -> contentId == null ? null : "contentid://" + contentId;
            case SHORTCUT -> key == null || parameter == null ? null : "shortcut://" + key + "/" + parameter;
        };
    }

    private String version() {
        return versionAtSave == null ? "" : "@v" + versionAtSave;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RESOURCE_IDENTIFIER;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
