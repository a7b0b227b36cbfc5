package io.github.drompincen.javacron.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Remote host an event can be bound to. Exactly one of {@code sshKey} / {@code password} is used,
 * the key taking precedence.
 */
@Document(collection = "servers")
public class ServerDocument {

    @Id
    private String serverId;
    private String userId;
    private String name;
    private String address;
    private String username = "root";
    private int port = 22;
    private String sshKey;
    private String password;
    private Instant createdAt;

    public ServerDocument() {}

    public String getServerId() { return serverId; }
    public void setServerId(String serverId) { this.serverId = serverId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getSshKey() { return sshKey; }
    public void setSshKey(String sshKey) { this.sshKey = sshKey; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
