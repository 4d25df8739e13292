// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.strata.client;

import com.google.common.annotations.VisibleForTesting;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Representation of an error code and message.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class Status {

  // Row descriptions can embed whole keys; keep messages bounded.
  @VisibleForTesting
  static final int MAX_MESSAGE_LENGTH = 32 * 1024;
  @VisibleForTesting
  static final String ABBREVIATION_CHARS = "...";
  @VisibleForTesting
  static final int ABBREVIATION_CHARS_LENGTH = ABBREVIATION_CHARS.length();

  /** The kinds of error the resolver reports. */
  enum Code {
    OK("OK"),
    NOT_FOUND("Not found"),
    CORRUPTION("Corruption"),
    NOT_SUPPORTED("Not implemented"),
    INVALID_ARGUMENT("Invalid argument"),
    IO_ERROR("IO error"),
    ILLEGAL_STATE("Illegal state"),
    ABORTED("Aborted");

    private final String description;

    Code(String description) {
      this.description = description;
    }
  }

  // Keep a single OK status object else we'll end up instantiating tons of them.
  private static final Status STATIC_OK = new Status(Code.OK, "");

  private final Code code;
  private final String message;

  private Status(Code code, String msg) {
    this.code = code;
    if (msg.length() > MAX_MESSAGE_LENGTH) {
      // Truncate the message and indicate that it was abbreviated.
      this.message = msg.substring(0, MAX_MESSAGE_LENGTH - ABBREVIATION_CHARS_LENGTH) +
          ABBREVIATION_CHARS;
    } else {
      this.message = msg;
    }
  }

  // CHECKSTYLE:OFF
  public static Status OK() {
    return STATIC_OK;
  }

  public static Status NotFound(String msg) {
    return new Status(Code.NOT_FOUND, msg);
  }

  public static Status Corruption(String msg) {
    return new Status(Code.CORRUPTION, msg);
  }

  public static Status NotSupported(String msg) {
    return new Status(Code.NOT_SUPPORTED, msg);
  }

  public static Status InvalidArgument(String msg) {
    return new Status(Code.INVALID_ARGUMENT, msg);
  }

  public static Status IOError(String msg) {
    return new Status(Code.IO_ERROR, msg);
  }

  public static Status IllegalState(String msg) {
    return new Status(Code.ILLEGAL_STATE, msg);
  }

  public static Status Aborted(String msg) {
    return new Status(Code.ABORTED, msg);
  }
  // CHECKSTYLE:ON

  // Boolean status checks.

  public boolean ok() {
    return code == Code.OK;
  }

  public boolean isNotFound() {
    return code == Code.NOT_FOUND;
  }

  public boolean isCorruption() {
    return code == Code.CORRUPTION;
  }

  public boolean isNotSupported() {
    return code == Code.NOT_SUPPORTED;
  }

  public boolean isInvalidArgument() {
    return code == Code.INVALID_ARGUMENT;
  }

  public boolean isIOError() {
    return code == Code.IO_ERROR;
  }

  public boolean isIllegalState() {
    return code == Code.ILLEGAL_STATE;
  }

  public boolean isAborted() {
    return code == Code.ABORTED;
  }

  /**
   * Get enum code name.
   * Intended for internal use only.
   */
  String getCodeName() {
    return code.name();
  }

  /**
   * Returns string error message.
   * Intended for internal use only.
   */
  String getMessage() {
    return message;
  }

  /**
   * Get a human-readable version of the Status message fit for logging or display.
   */
  @Override
  public String toString() {
    if (code == Code.OK) {
      return code.description;
    }
    return String.format("%s: %s", code.description, message);
  }
}
