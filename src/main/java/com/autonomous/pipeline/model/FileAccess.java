package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Write allow-list enforced by the external file-access hook. Empty means unrestricted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileAccess {
    private List<String> allowWrite = new ArrayList<>();
}
