// file: server/src/main/java/io/backlite/server/dto/StatusRequest.java
package io.backlite.server.dto;

/** JSON body for PATCH /api/admin/users/{id}/status, e.g. { "isActive": false }. */
public class StatusRequest {
    public Boolean isActive;
}
