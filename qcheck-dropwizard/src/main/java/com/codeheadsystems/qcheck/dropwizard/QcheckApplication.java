package com.codeheadsystems.qcheck.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Standalone application hosting the queue file check gateway.
 */
public class QcheckApplication extends Application<QcheckConfiguration> {

  public static void main(String[] args) throws Exception {
    new QcheckApplication().run(args);
  }

  @Override
  public String getName() {
    return "qcheck";
  }

  @Override
  public void initialize(Bootstrap<QcheckConfiguration> bootstrap) {
    bootstrap.addBundle(new QcheckBundle<>());
  }

  @Override
  public void run(QcheckConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
