package com.example.knowledgesync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of POST /sync.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    private boolean async;
}
