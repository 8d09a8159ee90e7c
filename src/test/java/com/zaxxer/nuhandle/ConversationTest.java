/*
 * Copyright (C) 2013 Brett Wooldridge
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.zaxxer.nuhandle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Runs both sides of a {@link Conversation} in one JVM, with the child side
 * on a worker thread.
 */
public class ConversationTest
{
   private QueueChannel<Object> childToParent;
   private QueueChannel<Object> parentToChild;
   private ExecutorService childSide;

   @Before
   public void setup()
   {
      childToParent = new QueueChannel<Object>("child-to-parent");
      parentToChild = new QueueChannel<Object>("parent-to-child");
      childSide = Executors.newSingleThreadExecutor();
   }

   @After
   public void teardown()
   {
      childSide.shutdownNow();
   }

   private Future<Object> run(final Conversation conversation, final Arguments arguments)
   {
      return childSide.submit(new Callable<Object>() {
         @Override
         public Object call() throws Exception
         {
            return conversation.start(arguments);
         }
      });
   }

   @Test
   public void yieldedValuesArriveInOrder() throws Exception
   {
      Conversation conversation = new Conversation(Generators.of(1, 2, 5), childToParent, parentToChild);
      conversation.sendToChild(null);
      conversation.sendToChild(null);
      conversation.sendToChild(null);

      Future<Object> outcome = run(conversation, Arguments.none());

      List<Object> values = new ArrayList<Object>();
      for (int i = 0; i < 3; i++) {
         values.add(conversation.getFromChild());
      }

      assertThat(values, contains((Object) 1, 2, 5));
      assertThat(outcome.get(5, TimeUnit.SECONDS), is(nullValue()));
      assertThat(conversation.getState(), is(Conversation.State.TERMINATED));
   }

   @Test
   public void sentValueBecomesTheValueOfTheYield() throws Exception
   {
      ChildGenerator echo = args -> new Generator() {
         private int step;

         @Override
         public Step next(Object sent)
         {
            switch (step++) {
            case 0:
               return Step.yielded("ready");
            case 1:
               return Step.yielded("got " + sent);
            default:
               return Step.done(sent);
            }
         }
      };

      Conversation conversation = new Conversation(echo, childToParent, parentToChild);
      Future<Object> outcome = run(conversation, Arguments.none());

      assertThat(conversation.getFromChild(), equalTo((Object) "ready"));
      conversation.sendToChild("ping");
      assertThat(conversation.getFromChild(), equalTo((Object) "got ping"));
      conversation.sendToChild("last");

      assertThat(outcome.get(5, TimeUnit.SECONDS), equalTo((Object) "last"));
   }

   @Test
   public void childWaitsForTheParentAtEachYield() throws Exception
   {
      Conversation conversation = new Conversation(Generators.of("only"), childToParent, parentToChild);
      assertThat(conversation.getState(), is(Conversation.State.CREATED));

      Future<Object> outcome = run(conversation, Arguments.none());
      assertThat(conversation.getFromChild(), equalTo((Object) "only"));

      long deadline = System.currentTimeMillis() + 5000;
      while (conversation.getState() != Conversation.State.WAITING_FOR_PARENT && System.currentTimeMillis() < deadline) {
         Thread.sleep(5);
      }
      assertThat(conversation.getState(), is(Conversation.State.WAITING_FOR_PARENT));
      Assert.assertFalse(outcome.isDone());

      conversation.sendToChild(null);
      outcome.get(5, TimeUnit.SECONDS);
      assertThat(conversation.getState(), is(Conversation.State.TERMINATED));
   }

   @Test
   public void generatorWithoutYieldsFinishesImmediately() throws Exception
   {
      ChildGenerator empty = args -> sent -> Step.done();

      Conversation conversation = new Conversation(empty, childToParent, parentToChild);
      assertThat(conversation.start(Arguments.none()), is(nullValue()));
      Assert.assertTrue(childToParent.isEmpty());
   }

   @Test
   public void argumentsReachTheGenerator() throws Exception
   {
      ChildGenerator countdown = args -> new Generator() {
         private int remaining = args.<Integer>get("from");

         @Override
         public Step next(Object sent)
         {
            return remaining > 0 ? Step.yielded(remaining--) : Step.done();
         }
      };

      Conversation conversation = new Conversation(countdown, childToParent, parentToChild);
      conversation.sendToChild(null);
      conversation.sendToChild(null);
      conversation.sendToChild(null);
      conversation.start(new Arguments(Collections.emptyList(), Collections.singletonMap("from", 3)));

      assertThat(childToParent.take(), equalTo((Object) 3));
      assertThat(childToParent.take(), equalTo((Object) 2));
      assertThat(childToParent.take(), equalTo((Object) 1));
   }

   @Test
   public void failingStepAbortsTheGeneratorAndPropagates() throws Exception
   {
      final List<Throwable> aborted = new ArrayList<Throwable>();
      ChildGenerator failing = args -> new Generator() {
         @Override
         public Step next(Object sent)
         {
            if (sent == null) {
               return Step.yielded("first");
            }
            throw new IllegalStateException("bad " + sent);
         }

         @Override
         public void abort(Throwable failure)
         {
            aborted.add(failure);
         }
      };

      Conversation conversation = new Conversation(failing, childToParent, parentToChild);
      conversation.sendToChild("input");

      try {
         conversation.start(Arguments.none());
         Assert.fail("The step failure should propagate");
      }
      catch (IllegalStateException e) {
         assertThat(e.getMessage(), equalTo("bad input"));
         Assert.assertEquals(1, aborted.size());
         Assert.assertSame(e, aborted.get(0));
      }

      assertThat(conversation.getState(), is(Conversation.State.FAILED));
      assertThat(childToParent.take(), equalTo((Object) "first"));
   }

   @Test
   public void cleanupFailureIsSuppressed() throws Exception
   {
      ChildGenerator failing = args -> new Generator() {
         @Override
         public Step next(Object sent)
         {
            throw new UnsupportedOperationException("step");
         }

         @Override
         public void abort(Throwable failure)
         {
            throw new IllegalStateException("cleanup");
         }
      };

      try {
         new Conversation(failing, childToParent, parentToChild).start(Arguments.none());
         Assert.fail();
      }
      catch (UnsupportedOperationException e) {
         Assert.assertEquals(1, e.getSuppressed().length);
         assertThat(e.getSuppressed()[0].getMessage(), equalTo("cleanup"));
      }
   }

   @Test
   public void closedParentChannelEndsThePendingRead() throws Exception
   {
      Conversation conversation = new Conversation(Generators.of(1), childToParent, parentToChild);
      Future<Object> outcome = run(conversation, Arguments.none());

      assertThat(conversation.getFromChild(), equalTo((Object) 1));
      parentToChild.close();

      try {
         outcome.get(5, TimeUnit.SECONDS);
         Assert.fail();
      }
      catch (ExecutionException e) {
         assertThat(e.getCause(), instanceOf(ChannelClosedException.class));
      }
   }

   @Test(expected = IllegalArgumentException.class)
   public void functionIsRequired()
   {
      new Conversation(null, childToParent, parentToChild);
   }
}
