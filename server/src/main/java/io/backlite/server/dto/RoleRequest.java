// file: server/src/main/java/io/backlite/server/dto/RoleRequest.java
package io.backlite.server.dto;

/** JSON body for PATCH /api/admin/users/{id}/role, e.g. { "role": "EMPLOYEE" }. */
public class RoleRequest {
    public String role;
}
