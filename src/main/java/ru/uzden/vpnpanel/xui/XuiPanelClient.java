package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.PanelApiException;
import ru.uzden.vpnpanel.exceptions.PanelAuthenticationException;
import ru.uzden.vpnpanel.exceptions.PanelConnectionException;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.ClientSpec;
import ru.uzden.vpnpanel.model.ClientTraffic;
import ru.uzden.vpnpanel.model.ProvisionedClient;
import ru.uzden.vpnpanel.model.VpnProtocol;
import ru.uzden.vpnpanel.services.PanelSessionCache;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Клиент API одной панели 3x-ui. Экземпляр живёт в пределах одной цепочки вызовов
 * (создаётся {@link XuiPanelClientFactory}), сессия панели хранится в {@link PanelSessionCache}.
 * <p>
 * Любой вызов делает не больше двух попыток: если панель ответила признаком истёкшей сессии,
 * cookie сбрасывается, выполняется один логин и запрос повторяется ровно один раз.
 */
@Slf4j
public class XuiPanelClient {

    static final String LOGIN_PATH = "/login";
    static final String API_BASE = "/panel/api/inbounds";

    private final RestClient rest;
    private final long panelId;
    private final String baseUrl;
    private final String username;
    private final String password;
    private final PanelSessionCache sessionCache;
    private final ObjectMapper om;

    // cookie вида "3x-ui=...." или "session=....", может быть несколько через "; "
    private String sessionCookie;

    public XuiPanelClient(RestClient rest,
                          long panelId,
                          String baseUrl,
                          String username,
                          String password,
                          PanelSessionCache sessionCache,
                          ObjectMapper om) {
        this.rest = rest;
        this.panelId = panelId;
        this.baseUrl = baseUrl;
        this.username = username;
        this.password = password;
        this.sessionCache = sessionCache;
        this.om = om;
    }

    public long getPanelId() {
        return panelId;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /* ============================ auth ============================ */

    /**
     * Логин формой. Успех - только HTTP 200 и success=true; cookie кладётся в кэш сессий.
     */
    public String login() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", username);
        form.add("password", password);
        // 2FA на панелях не используем
        form.add("twoFactorCode", "");

        PanelResponse resp;
        try {
            resp = rest.post()
                    .uri(LOGIN_PATH)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .header(HttpHeaders.ACCEPT, "application/json, text/plain, */*")
                    .body(form)
                    .exchange((request, response) -> new PanelResponse(
                            response.getStatusCode().value(),
                            response.getHeaders().getFirst(HttpHeaders.LOCATION),
                            response.getHeaders().getOrEmpty(HttpHeaders.SET_COOKIE),
                            StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)
                    ));
        } catch (ResourceAccessException e) {
            throw new PanelConnectionException("Panel " + panelId + " is unreachable: " + safeMsg(e), e);
        }

        JsonNode json = tryParse(resp.body());
        boolean ok = resp.status() == 200 && json != null && json.path("success").asBoolean(false);
        if (!ok) {
            String msg = json == null ? null : InboundJson.textOrNull(json, "msg");
            log.warn("[panel {}] login failed: status={}, msg={}", panelId, resp.status(), msg);
            throw new PanelAuthenticationException(
                    "Login failed: " + (msg == null ? "HTTP " + resp.status() : msg), resp.status());
        }

        String cookie = joinCookies(resp.cookies());
        if (cookie == null) {
            throw new PanelAuthenticationException("Login failed: Set-Cookie not found", resp.status());
        }
        this.sessionCookie = cookie;
        sessionCache.put(panelId, cookie);
        log.info("[panel {}] login ok, cookie name={}", panelId, cookieNames(cookie));
        return cookie;
    }

    private String ensureSession() {
        if (sessionCookie != null) return sessionCookie;
        Optional<String> cached = sessionCache.get(panelId);
        if (cached.isPresent()) {
            sessionCookie = cached.get();
            return sessionCookie;
        }
        return login();
    }

    private void dropSession() {
        sessionCookie = null;
        sessionCache.evict(panelId);
    }

    /* ============================ public API ============================ */

    /**
     * Все inbound'ы панели как есть (settings/streamSettings обычно строками JSON).
     */
    public List<JsonNode> getInbounds() {
        JsonNode root = execute("getInbounds", HttpMethod.GET, null, API_BASE + "/list");
        JsonNode obj = root.path("obj");
        if (obj.isNull() || obj.isMissingNode()) {
            return List.of();
        }
        if (!obj.isArray()) {
            throw new PanelApiException("getInbounds: unexpected payload, obj is not a list", 200);
        }
        List<JsonNode> out = new ArrayList<>(obj.size());
        obj.forEach(out::add);
        log.debug("[panel {}] fetched {} inbounds", panelId, out.size());
        return out;
    }

    public Optional<JsonNode> getInbound(int remoteInboundId) {
        try {
            JsonNode root = execute("getInbound", HttpMethod.GET, null, API_BASE + "/get/{id}", remoteInboundId);
            JsonNode obj = root.path("obj");
            if (!obj.isObject() || obj.isEmpty()) return Optional.empty();
            return Optional.of(obj);
        } catch (PanelApiException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    public ProvisionedClient addClient(int remoteInboundId, ClientSpec spec, VpnProtocol protocol) {
        XuiClientPayloads.validate(spec, protocol);

        ObjectNode client = XuiClientPayloads.clientObject(om, spec, protocol);
        ObjectNode payload = XuiClientPayloads.settingsEnvelope(om, remoteInboundId, client);

        execute("addClient", HttpMethod.POST, payload, API_BASE + "/addClient");

        ClientIdentifier identifier = XuiClientPayloads.nativeIdentifier(spec, protocol);
        String subscriptionUrl = XuiClientPayloads.subscriptionUrl(baseUrl, spec, identifier);
        log.info("[panel {}] client {} added to inbound {}", panelId, spec.email(), remoteInboundId);
        return new ProvisionedClient(identifier, subscriptionUrl);
    }

    /**
     * Читает текущий объект клиента, накладывает updates поверх и отправляет целиком.
     */
    public boolean updateClient(int remoteInboundId, ClientIdentifier identifier, Map<String, Object> updates) {
        if (updates == null) {
            throw new IllegalArgumentException("updates must not be null");
        }
        ObjectNode current = getClientDetails(identifier, remoteInboundId)
                .orElseThrow(() -> new NotFoundException(
                        "Client " + identifier + " not found in inbound " + remoteInboundId + " on panel " + panelId));

        ObjectNode merged = current.deepCopy();
        updates.forEach((k, v) -> merged.set(k, om.valueToTree(v)));

        ObjectNode payload = XuiClientPayloads.settingsEnvelope(om, remoteInboundId, merged);
        execute("updateClient", HttpMethod.POST, payload, API_BASE + "/updateClient/{value}", identifier.value());
        log.info("[panel {}] client {} updated, fields={}", panelId, identifier, updates.keySet());
        return true;
    }

    public boolean deleteClient(int remoteInboundId, ClientIdentifier identifier) {
        if (identifier.protocol() == VpnProtocol.SHADOWSOCKS) {
            execute("deleteClient", HttpMethod.POST, null,
                    API_BASE + "/{inbound}/delClientByEmail/{email}", remoteInboundId, identifier.value());
        } else {
            execute("deleteClient", HttpMethod.POST, null,
                    API_BASE + "/{inbound}/delClient/{value}", remoteInboundId, identifier.value());
        }
        log.info("[panel {}] client {} deleted from inbound {}", panelId, identifier, remoteInboundId);
        return true;
    }

    /**
     * Трафик клиента. Отсутствующий клиент - пустой результат, не ошибка.
     */
    public Optional<ClientTraffic> getClientTraffics(ClientIdentifier identifier) {
        JsonNode root;
        try {
            if (identifier.protocol() == VpnProtocol.SHADOWSOCKS) {
                root = execute("getClientTraffics", HttpMethod.GET, null,
                        API_BASE + "/getClientTraffics/{email}", identifier.value());
            } else {
                root = execute("getClientTraffics", HttpMethod.GET, null,
                        API_BASE + "/getClientTrafficsById/{value}", identifier.value());
            }
        } catch (PanelApiException e) {
            if (e.isNotFound()) {
                log.debug("[panel {}] no traffic for {}: {}", panelId, identifier, e.getMessage());
                return Optional.empty();
            }
            throw e;
        }

        JsonNode obj = root.path("obj");
        // getClientTrafficsById отдаёт массив
        if (obj.isArray()) {
            obj = obj.isEmpty() ? null : obj.get(0);
        }
        if (obj == null || !obj.isObject() || obj.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ClientTraffic(
                obj.path("up").asLong(0),
                obj.path("down").asLong(0),
                obj.path("total").asLong(0),
                obj.path("expiryTime").asLong(0)
        ));
    }

    /**
     * Сброс трафика работает по email, поэтому для не-shadowsocks email ищется в inbound'е.
     */
    public boolean resetClientTraffic(ClientIdentifier identifier, int remoteInboundId) {
        String email;
        if (identifier.protocol() == VpnProtocol.SHADOWSOCKS) {
            email = identifier.value();
        } else {
            Optional<ObjectNode> details = getClientDetails(identifier, remoteInboundId);
            email = details.map(d -> InboundJson.textOrNull(d, "email")).orElse(null);
            if (email == null) {
                log.warn("[panel {}] reset traffic: client {} not found in inbound {}", panelId, identifier, remoteInboundId);
                return false;
            }
        }
        try {
            execute("resetClientTraffic", HttpMethod.POST, null,
                    API_BASE + "/{inbound}/resetClientTraffic/{email}", remoteInboundId, email);
            return true;
        } catch (PanelApiException e) {
            if (e.isNotFound()) return false;
            throw e;
        }
    }

    /**
     * Объект клиента из settings.clients[] inbound'а, поиск по ключевому полю протокола.
     */
    public Optional<ObjectNode> getClientDetails(ClientIdentifier identifier, int remoteInboundId) {
        Optional<JsonNode> inbound = getInbound(remoteInboundId);
        if (inbound.isEmpty()) return Optional.empty();

        JsonNode settings;
        try {
            settings = InboundJson.embeddedObject(om, inbound.get(), "settings");
        } catch (IllegalArgumentException e) {
            throw new PanelApiException("Inbound " + remoteInboundId + " has malformed settings: " + e.getMessage(), 200);
        }
        JsonNode clients = settings.path("clients");
        if (!clients.isArray()) return Optional.empty();

        String keyField = identifier.keyField();
        for (JsonNode c : clients) {
            if (c.isObject() && identifier.value().equals(c.path(keyField).asText(null))) {
                return Optional.of((ObjectNode) c);
            }
        }
        return Optional.empty();
    }

    /* ============================ http ============================ */

    private JsonNode execute(String operation, HttpMethod method, JsonNode body, String path, Object... uriVars) {
        String jsonBody = body == null ? null : writeJson(body);

        PanelResponse resp = send(method, jsonBody, ensureSession(), path, uriVars);
        if (isAuthFailure(resp)) {
            log.warn("[panel {}] {}: session rejected (HTTP {}), logging in again", panelId, operation, resp.status());
            dropSession();
            String cookie = login();
            resp = send(method, jsonBody, cookie, path, uriVars);
            if (isAuthFailure(resp)) {
                log.error("[panel {}] {}: authentication failed even after re-login", panelId, operation);
                throw new PanelAuthenticationException(
                        operation + ": authentication failed after re-login", resp.status());
            }
        }
        return unwrap(operation, resp);
    }

    private PanelResponse send(HttpMethod method, String jsonBody, String cookie, String path, Object... uriVars) {
        try {
            RestClient.RequestBodySpec spec = rest.method(method)
                    .uri(path, uriVars)
                    .header(HttpHeaders.COOKIE, cookie)
                    .header(HttpHeaders.ACCEPT, "application/json, text/plain, */*")
                    .header("X-Requested-With", "XMLHttpRequest")
                    .header(HttpHeaders.REFERER, baseUrl + "/panel/inbounds");
            if (jsonBody != null) {
                spec.contentType(MediaType.APPLICATION_JSON).body(jsonBody);
            }
            return spec.exchange((request, response) -> new PanelResponse(
                    response.getStatusCode().value(),
                    response.getHeaders().getFirst(HttpHeaders.LOCATION),
                    List.of(),
                    StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)
            ));
        } catch (ResourceAccessException e) {
            log.error("[panel {}] {} {} failed: {}", panelId, method, path, safeMsg(e));
            throw new PanelConnectionException("Panel " + panelId + " is unreachable: " + safeMsg(e), e);
        }
    }

    /**
     * Признаки того, что панель не приняла сессию: 401/403, редирект на /login,
     * HTML-страница логина вместо JSON, success=false с "expire" в сообщении.
     */
    private boolean isAuthFailure(PanelResponse resp) {
        int s = resp.status();
        if (s == 401 || s == 403) return true;
        if (s >= 300 && s < 400) {
            return resp.location() != null && resp.location().contains(LOGIN_PATH);
        }
        if (s >= 200 && s < 300) {
            if (looksLikeHtml(resp.body())) return true;
            JsonNode json = tryParse(resp.body());
            if (json != null && json.path("success").isBoolean() && !json.path("success").asBoolean()) {
                String msg = json.path("msg").asText("");
                return msg.toLowerCase(Locale.ROOT).contains("expire");
            }
        }
        return false;
    }

    private JsonNode unwrap(String operation, PanelResponse resp) {
        int s = resp.status();
        if (s < 200 || s >= 300) {
            log.error("[panel {}] {}: HTTP {} {}", panelId, operation, s, snippet(resp.body()));
            throw new PanelApiException(operation + " failed: HTTP " + s, s);
        }
        JsonNode root = tryParse(resp.body());
        if (root == null || !root.isObject()) {
            throw new PanelApiException(operation + ": invalid JSON response from panel", s);
        }
        if (!root.path("success").asBoolean(false)) {
            String msg = InboundJson.textOrNull(root, "msg");
            log.error("[panel {}] {}: API error: {}", panelId, operation, msg);
            throw new PanelApiException(operation + " failed: " + (msg == null ? "unknown error" : msg), s);
        }
        return root;
    }

    private JsonNode tryParse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request body", e);
        }
    }

    /* ============================ misc ============================ */

    private static boolean looksLikeHtml(String body) {
        if (body == null) return false;
        String t = body.stripLeading().toLowerCase(Locale.ROOT);
        return t.startsWith("<!doctype html") || t.startsWith("<html");
    }

    private static String joinCookies(List<String> setCookies) {
        List<String> parts = new ArrayList<>();
        for (String sc : setCookies) {
            if (sc == null || sc.isBlank()) continue;
            // возьмем только cookie до ';'
            String c = sc.split(";", 2)[0].trim();
            if (!c.isEmpty()) parts.add(c);
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String cookieNames(String cookie) {
        List<String> names = new ArrayList<>();
        for (String c : cookie.split(";")) {
            String t = c.trim();
            int eq = t.indexOf('=');
            names.add(eq > 0 ? t.substring(0, eq) : t);
        }
        return String.join(",", names);
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    private record PanelResponse(int status, String location, List<String> cookies, String body) {
    }
}
