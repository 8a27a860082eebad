package com.autopost.scheduler.client;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {
    private String id;
    private String username;
    private AccountStatus status;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
