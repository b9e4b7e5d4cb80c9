package com.example.courier.shared.config;

import com.example.courier.shared.model.UserRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
@Validated
public class AppProperties {

    private String instanceId;

    @Valid
    private final Service service = new Service();
    @Valid
    private final Websocket websocket = new Websocket();
    @Valid
    private final Router router = new Router();
    @Valid
    private final Auth auth = new Auth();
    @Valid
    private final Client client = new Client();

    @Data
    public static class Service {
        @NotBlank
        private String name = "courier-realtime";
    }

    @Data
    public static class Websocket {
        @NotBlank
        private String path = "/api/ws/connect";
        /** Frames queued per connection and not yet written before it is dropped as a slow consumer. Enforced exactly. */
        @Positive
        private int outboundBufferSize = 256;
        @Positive
        private long heartbeatInterval = 30000L;
        /** Inbound silence after which a connection is closed; 0 disables the check. */
        @Min(0)
        private long idleTimeout = 600000L;
        @Positive
        private long closeGracePeriod = 2000L;
        @Min(0)
        private long shutdownNoticeDelay = 500L;
        /** Largest inbound frame payload, in bytes; bigger frames close the connection. */
        @Positive
        private int maxFramePayloadLength = 65536;
    }

    @Data
    public static class Router {
        @NotBlank
        private String threadName = "event-router";
    }

    @Data
    public static class Auth {
        @NotBlank
        private String tokenParameter = "token";
        @NotEmpty
        private Set<UserRole> allowedRoles = EnumSet.allOf(UserRole.class);
        @Valid
        private List<TokenGrant> tokens = new ArrayList<>();

        @Data
        public static class TokenGrant {
            @NotBlank
            private String token;
            @NotNull
            private Long userId;
            @NotNull
            private UserRole role;
            private boolean active = true;
        }
    }

    @Data
    public static class Client {
        @Positive
        private int maxReconnectAttempts = 5;
        @Positive
        private long backoffCap = 30000L;
        @Positive
        private long pingInterval = 30000L;
    }
}
