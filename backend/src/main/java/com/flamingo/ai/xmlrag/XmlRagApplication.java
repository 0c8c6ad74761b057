package com.flamingo.ai.xmlrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the XML classification and chunking service. */
@SpringBootApplication
public class XmlRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(XmlRagApplication.class, args);
  }
}
