package io.github.drompincen.javacron.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "user_variables")
@CompoundIndex(name = "user_key_idx", def = "{'userId': 1, 'key': 1}", unique = true)
public class UserVariableDocument {

    @Id
    private String variableId;
    private String userId;
    private String key;
    private String value;
    private Instant createdAt;
    private Instant updatedAt;

    public UserVariableDocument() {}

    public String getVariableId() { return variableId; }
    public void setVariableId(String variableId) { this.variableId = variableId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }
    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
