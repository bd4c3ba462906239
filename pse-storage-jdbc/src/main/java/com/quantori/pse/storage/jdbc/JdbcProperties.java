package com.quantori.pse.storage.jdbc;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

@Builder
@Data
public class JdbcProperties {
  String url;
  String user;
  @ToString.Exclude
  String password;
  String table;
  WriteMode mode;
}
