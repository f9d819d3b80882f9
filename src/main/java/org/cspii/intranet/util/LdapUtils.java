package org.cspii.intranet.util;

import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for reading directory attributes.
 */
public final class LdapUtils {

    private LdapUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Decode a raw attribute value. The directory hands back either a String or,
     * for attributes it treats as binary, the UTF-8 encoded bytes.
     *
     * @return the decoded value, or null if the value is null
     */
    public static String decodeValue(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return raw.toString();
    }

    /**
     * First value of the attribute, decoded, or null when the attribute is absent.
     */
    public static String getAttribute(Attributes attrs, String attrId) throws NamingException {
        Attribute attribute = attrs.get(attrId);
        if (attribute == null || attribute.size() == 0) {
            return null;
        }
        return decodeValue(attribute.get());
    }
}
