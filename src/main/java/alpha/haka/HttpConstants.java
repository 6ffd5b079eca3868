package alpha.haka;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only the constants that the server itself produces or interprets are
 * declared. Applications are free to use any other method token, status code
 * or header name.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * HTTP methods are included on the first line of a request and indicates
     * the desired action to be performed on a server-side resource.<p>
     *
     * The method is a case-sensitive string and can be anything. The router
     * matches the token exactly as received.
     */
    public static final class Method {
        private Method() {
            // Empty
        }

        /** Retrieve a representation of the target resource. */
        public static final String GET = "GET";

        /** Let the target resource process the request. */
        public static final String POST = "POST";
    }

    /**
     * Status codes that the server knows a reason phrase for.<p>
     *
     * A response may carry any status code; an unknown code goes out with the
     * reason phrase {@value ReasonPhrase#UNKNOWN_STATUS}.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }

        /** Continue. */
        public static final int ONE_HUNDRED = 100;
        /** Switching Protocols. */
        public static final int ONE_HUNDRED_ONE = 101;
        /** OK. */
        public static final int TWO_HUNDRED = 200;
        /** Created. */
        public static final int TWO_HUNDRED_ONE = 201;
        /** Accepted. */
        public static final int TWO_HUNDRED_TWO = 202;
        /** No Content. */
        public static final int TWO_HUNDRED_FOUR = 204;
        /** Moved Permanently. */
        public static final int THREE_HUNDRED_ONE = 301;
        /** Found. */
        public static final int THREE_HUNDRED_TWO = 302;
        /** Not Modified. */
        public static final int THREE_HUNDRED_FOUR = 304;
        /**
         * Bad Request.<p>
         *
         * Used by the server for a malformed request line and for a static
         * file request that tries to escape its root directory.
         */
        public static final int FOUR_HUNDRED = 400;
        /** Unauthorized. */
        public static final int FOUR_HUNDRED_ONE = 401;
        /** Forbidden. */
        public static final int FOUR_HUNDRED_THREE = 403;
        /**
         * Not Found.<p>
         *
         * Used by the server when no static file and no route matches.
         */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** Method Not Allowed. */
        public static final int FOUR_HUNDRED_FIVE = 405;
        /**
         * Internal Server Error.<p>
         *
         * Used by the server when a request handler fails.
         */
        public static final int FIVE_HUNDRED = 500;
        /** Not Implemented. */
        public static final int FIVE_HUNDRED_ONE = 501;
        /** Service Unavailable. */
        public static final int FIVE_HUNDRED_THREE = 503;
    }

    /**
     * Reason phrases of the status codes in {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }

        /** Goes with status code {@value StatusCode#ONE_HUNDRED}. */
        public static final String CONTINUE = "Continue";
        /** Goes with status code {@value StatusCode#ONE_HUNDRED_ONE}. */
        public static final String SWITCHING_PROTOCOLS = "Switching Protocols";
        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";
        /** Goes with status code {@value StatusCode#TWO_HUNDRED_ONE}. */
        public static final String CREATED = "Created";
        /** Goes with status code {@value StatusCode#TWO_HUNDRED_TWO}. */
        public static final String ACCEPTED = "Accepted";
        /** Goes with status code {@value StatusCode#TWO_HUNDRED_FOUR}. */
        public static final String NO_CONTENT = "No Content";
        /** Goes with status code {@value StatusCode#THREE_HUNDRED_ONE}. */
        public static final String MOVED_PERMANENTLY = "Moved Permanently";
        /** Goes with status code {@value StatusCode#THREE_HUNDRED_TWO}. */
        public static final String FOUND = "Found";
        /** Goes with status code {@value StatusCode#THREE_HUNDRED_FOUR}. */
        public static final String NOT_MODIFIED = "Not Modified";
        /** Goes with status code {@value StatusCode#FOUR_HUNDRED}. */
        public static final String BAD_REQUEST = "Bad Request";
        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_ONE}. */
        public static final String UNAUTHORIZED = "Unauthorized";
        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_THREE}. */
        public static final String FORBIDDEN = "Forbidden";
        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";
        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FIVE}. */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_ONE}. */
        public static final String NOT_IMPLEMENTED = "Not Implemented";
        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_THREE}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        /** Goes with any status code not listed in {@link StatusCode}. */
        public static final String UNKNOWN_STATUS = "Unknown Status";

        /**
         * Returns the reason phrase of the given status code.
         *
         * @param statusCode any integer
         * @return the reason phrase, or {@value #UNKNOWN_STATUS}
         */
        public static String of(int statusCode) {
            switch (statusCode) {
                case StatusCode.ONE_HUNDRED:        return CONTINUE;
                case StatusCode.ONE_HUNDRED_ONE:    return SWITCHING_PROTOCOLS;
                case StatusCode.TWO_HUNDRED:        return OK;
                case StatusCode.TWO_HUNDRED_ONE:    return CREATED;
                case StatusCode.TWO_HUNDRED_TWO:    return ACCEPTED;
                case StatusCode.TWO_HUNDRED_FOUR:   return NO_CONTENT;
                case StatusCode.THREE_HUNDRED_ONE:  return MOVED_PERMANENTLY;
                case StatusCode.THREE_HUNDRED_TWO:  return FOUND;
                case StatusCode.THREE_HUNDRED_FOUR: return NOT_MODIFIED;
                case StatusCode.FOUR_HUNDRED:       return BAD_REQUEST;
                case StatusCode.FOUR_HUNDRED_ONE:   return UNAUTHORIZED;
                case StatusCode.FOUR_HUNDRED_THREE: return FORBIDDEN;
                case StatusCode.FOUR_HUNDRED_FOUR:  return NOT_FOUND;
                case StatusCode.FOUR_HUNDRED_FIVE:  return METHOD_NOT_ALLOWED;
                case StatusCode.FIVE_HUNDRED:       return INTERNAL_SERVER_ERROR;
                case StatusCode.FIVE_HUNDRED_ONE:   return NOT_IMPLEMENTED;
                case StatusCode.FIVE_HUNDRED_THREE: return SERVICE_UNAVAILABLE;
                default:                            return UNKNOWN_STATUS;
            }
        }
    }

    /**
     * Header names used by the server.
     */
    public static final class HeaderKey {
        private HeaderKey() {
            // Empty
        }

        /**
         * The number of bytes in the response body.<p>
         *
         * Always computed by the server; a value set by the application is
         * ignored.
         */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** The media type of the body. */
        public static final String CONTENT_TYPE = "Content-Type";
    }
}
