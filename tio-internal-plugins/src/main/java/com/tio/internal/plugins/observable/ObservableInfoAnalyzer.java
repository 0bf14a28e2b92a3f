package com.tio.internal.plugins.observable;

import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.ObservableClassification;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Offline analyzer describing the observable itself: normalized form, and per type the TLD (domain),
 * host (URL), address family and scope (IP), or digest algorithm (hash). Makes no network calls.
 */
public final class ObservableInfoAnalyzer implements PluginHandler {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    @Override
    public Map<String, Object> run(PluginInvocation invocation) throws Exception {
        String name = invocation.getObservableName() != null ? invocation.getObservableName().trim() : "";
        ObservableClassification type = invocation.getClassification();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("observable", name);
        out.put("classification", type != null ? type.name().toLowerCase(Locale.ROOT) : "file");
        if (type == null) {
            out.put("mime_type", invocation.getMimeType());
            return out;
        }
        switch (type) {
            case DOMAIN:
                describeDomain(name, out);
                break;
            case URL:
                describeUrl(name, out);
                break;
            case IP:
                describeIp(name, out);
                break;
            case HASH:
                out.put("algorithm", hashAlgorithm(name));
                break;
            default:
                out.put("length", name.length());
                break;
        }
        return out;
    }

    private static void describeDomain(String name, Map<String, Object> out) {
        String normalized = name.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) normalized = normalized.substring(0, normalized.length() - 1);
        out.put("normalized", normalized);
        int dot = normalized.lastIndexOf('.');
        out.put("tld", dot >= 0 ? normalized.substring(dot + 1) : "");
        out.put("labels", normalized.isEmpty() ? 0 : normalized.split("\\.").length);
    }

    private static void describeUrl(String name, Map<String, Object> out) {
        URI uri = URI.create(name);
        out.put("scheme", uri.getScheme());
        out.put("host", uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : null);
        out.put("path", uri.getPath());
    }

    private static void describeIp(String name, Map<String, Object> out) throws UnknownHostException {
        if (!IPV4.matcher(name).matches() && !name.contains(":")) {
            throw new IllegalArgumentException("Not an IP literal: " + name);
        }
        // getByName does not resolve literals
        InetAddress address = InetAddress.getByName(name);
        out.put("version", name.contains(":") ? 6 : 4);
        out.put("private", address.isSiteLocalAddress());
        out.put("loopback", address.isLoopbackAddress());
        out.put("link_local", address.isLinkLocalAddress());
    }

    static String hashAlgorithm(String hash) {
        if (!HEX.matcher(hash).matches()) return "unknown";
        switch (hash.length()) {
            case 32:
                return "md5";
            case 40:
                return "sha1";
            case 64:
                return "sha256";
            case 128:
                return "sha512";
            default:
                return "unknown";
        }
    }
}
