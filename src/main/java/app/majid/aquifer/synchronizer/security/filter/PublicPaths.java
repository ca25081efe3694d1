package app.majid.aquifer.synchronizer.security.filter;

final class PublicPaths {

    private PublicPaths() {
        // utility
    }

    static boolean isPublic(String path) {
        return path.startsWith("/actuator") ||
               path.startsWith("/swagger-ui") ||
               path.startsWith("/v3/api-docs");
    }
}
