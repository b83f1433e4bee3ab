package com.kyc.vision.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Raw bytes of a submitted file together with the name used for type detection. */
@Getter
@AllArgsConstructor
public class LoadedSource {
  private final String filename;
  private final byte[] data;
}
