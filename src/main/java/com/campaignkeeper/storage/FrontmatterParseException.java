package com.campaignkeeper.storage;

import java.io.IOException;

/**
 * A content file whose frontmatter header cannot be read as a key-value map.
 */
public class FrontmatterParseException extends IOException {

    public FrontmatterParseException(String message) {
        super(message);
    }

    public FrontmatterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
